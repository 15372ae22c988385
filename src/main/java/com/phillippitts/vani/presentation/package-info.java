/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service, never the reverse. Controllers are thin adapters; the
 * assistant logic lives in {@code service.turn} and below.
 *
 * <ul>
 *   <li>{@code presentation.controller} - {@code POST /api/turns}</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.vani.presentation;
