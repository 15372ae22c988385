/**
 * Spring wiring and externalized configuration.
 *
 * <ul>
 *   <li>{@link com.phillippitts.vani.config.AssistantConfig} - builds the utterance pipeline</li>
 *   <li>{@link com.phillippitts.vani.config.CollaboratorConfig} - "unavailable" fallbacks for
 *       every external collaborator</li>
 *   <li>{@link com.phillippitts.vani.config.SpeechExecutorConfig} - speech synthesis executor</li>
 * </ul>
 *
 * <p>Typed properties live in {@code config.properties} under the {@code assistant.*} prefix.
 */
package com.phillippitts.vani.config;
