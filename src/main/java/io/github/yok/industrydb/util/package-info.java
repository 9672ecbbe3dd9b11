/**
 * Utility package for IndustryDB.
 *
 * <p>
 * Provides stateless helpers shared by the other packages, such as masking credentials before
 * connection settings are logged.
 * </p>
 */
package io.github.yok.industrydb.util;
