/**
 * Quantile fuzzification and frequency-based rule mining.
 *
 * @since 1.0.0
 */
package com.processlens.core.fuzzy;
