/**
 * REST controllers. Thin adapters over {@link com.phillippitts.vani.service.turn.AssistantTurnService}.
 */
package com.phillippitts.vani.presentation.controller;
