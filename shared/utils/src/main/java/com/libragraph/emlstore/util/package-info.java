/**
 * Shared utilities for all emlstore modules.
 *
 * <p>Contains {@link com.libragraph.emlstore.util.ContentHash} (SHA-256), the identity
 * of every stored blob. No framework dependencies beyond Commons Codec.
 */
package com.libragraph.emlstore.util;
