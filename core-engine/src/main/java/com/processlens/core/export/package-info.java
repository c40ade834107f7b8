/**
 * CSV export of analysis tables.
 *
 * @since 1.0.0
 */
package com.processlens.core.export;
