/**
 * Request-scoped logging context for the REST surface.
 */
package com.phillippitts.vani.config.logging;
