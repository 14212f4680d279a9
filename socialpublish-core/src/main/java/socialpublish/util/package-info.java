/**
 * Small shared utilities.
 */
package socialpublish.util;
