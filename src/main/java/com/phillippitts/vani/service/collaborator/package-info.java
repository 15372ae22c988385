/**
 * External collaborator contracts. Implementations report failures with
 * {@code CollaboratorException} subtypes, never with empty data.
 */
package com.phillippitts.vani.service.collaborator;
