/**
 * Session memory. Single-writer per turn; see
 * {@link com.phillippitts.vani.service.context.ContextStore#apply(com.phillippitts.vani.service.context.ContextUpdate)}.
 */
package com.phillippitts.vani.service.context;
