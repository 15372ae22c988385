/**
 * Service layer: the utterance pipeline and the voice loop around it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.language} - script detection and text normalization</li>
 *   <li>{@code service.intent} - trigger rule table and priority-based intent resolution</li>
 *   <li>{@code service.extract} - slot extraction per intent schema</li>
 *   <li>{@code service.context} - bounded conversation memory with vision and search context</li>
 *   <li>{@code service.dispatch} - collaborator routing, fallback and localized responses</li>
 *   <li>{@code service.turn} - per-turn entry point and the listen/speak session</li>
 *   <li>{@code service.collaborator} - contracts for models, camera, search, desktop and speech</li>
 *   <li>{@code service.resource}, {@code service.metrics}, {@code service.events} - device leases,
 *       Micrometer meters and failure logging</li>
 * </ul>
 *
 * <p>Pipeline components are plain objects wired in {@code config.AssistantConfig}; they do not
 * depend on Spring and are constructed directly in unit tests.
 *
 * @since 1.0
 */
package com.phillippitts.vani.service;
