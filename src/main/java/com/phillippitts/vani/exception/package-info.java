/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.vani.exception.VaniException} and are
 * unchecked. Collaborators throw the {@code Collaborator*} and
 * {@link com.phillippitts.vani.exception.DesktopActionFailedException} types; the dispatcher
 * converts them into a {@link com.phillippitts.vani.domain.TurnStatus} and a spoken response,
 * so none of them terminates the process.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.vani.exception.CollaboratorException} - base for collaborator
 *       failures, carries the collaborator name</li>
 *   <li>{@link com.phillippitts.vani.exception.CollaboratorUnavailableException} - not
 *       reachable or not configured</li>
 *   <li>{@link com.phillippitts.vani.exception.CollaboratorTimeoutException} - no answer within
 *       the collaborator's timeout</li>
 *   <li>{@link com.phillippitts.vani.exception.DesktopActionFailedException} - action ran and
 *       failed; reason is user-facing</li>
 *   <li>{@link com.phillippitts.vani.exception.MissingParameterException},
 *       {@link com.phillippitts.vani.exception.StaleContextException},
 *       {@link com.phillippitts.vani.exception.EmptyUtteranceException},
 *       {@link com.phillippitts.vani.exception.UnresolvableIntentException} - per-turn
 *       conditions recovered locally</li>
 *   <li>{@link com.phillippitts.vani.exception.ResourceBusyException},
 *       {@link com.phillippitts.vani.exception.TurnCancelledException} - device leasing and
 *       user interrupts</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.vani.exception;
