/**
 * Utility classes for CSV output and fatal error reporting.
 */
package io.github.yok.crmexport.util;
