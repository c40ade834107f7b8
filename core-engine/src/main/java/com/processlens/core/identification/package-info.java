/**
 * First-order step-response identification and heuristic PID tuning.
 *
 * @since 1.0.0
 */
package com.processlens.core.identification;
