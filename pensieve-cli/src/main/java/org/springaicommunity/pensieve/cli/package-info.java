/**
 * Command line front end for Pensieve.
 */
@NullMarked
package org.springaicommunity.pensieve.cli;

import org.jspecify.annotations.NullMarked;
