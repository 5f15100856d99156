/**
 * Error taxonomy of the engine: {@link com.telemetrylens.core.error.Outcome}
 * for results that may lack data, and the exceptions for invalid parameters
 * and unavailable sources.
 */
package com.telemetrylens.core.error;
