/**
 * Maps request errors at the HTTP boundary to a standard {@code ApiError} body.
 */
package com.phillippitts.vani.presentation.exception;
