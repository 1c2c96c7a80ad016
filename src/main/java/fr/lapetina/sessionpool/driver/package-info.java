/**
 * Abstraction over the interactive target surface.
 *
 * <p>{@link fr.lapetina.sessionpool.driver.SessionDriver} is the single capability the pool
 * relies on. Site-specific locators live in {@link fr.lapetina.sessionpool.driver.Surface},
 * built from configuration. The production implementation is in the {@code playwright}
 * subpackage.
 */
package fr.lapetina.sessionpool.driver;
