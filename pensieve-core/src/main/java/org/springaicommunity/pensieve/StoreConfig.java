package org.springaicommunity.pensieve;

/**
 * Configuration of one store, selected by the dotfile's {@code type} discriminator.
 */
public interface StoreConfig {

	/**
	 * The discriminator value that selects this kind of store.
	 */
	String type();

}
