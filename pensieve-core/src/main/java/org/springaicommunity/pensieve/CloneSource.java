package org.springaicommunity.pensieve;

/**
 * What the external {@code git clone} step needs to fetch a repository.
 *
 * @param url the URL passed to git
 * @param directoryName the directory the clone is created in
 */
public record CloneSource(String url, String directoryName) {

}
