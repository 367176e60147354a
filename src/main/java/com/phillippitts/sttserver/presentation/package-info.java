/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer but not vice versa. Controllers never throw
 * HTTP-specific exceptions; domain exceptions are translated in one place.
 *
 * @see com.phillippitts.sttserver.presentation.controller
 * @see com.phillippitts.sttserver.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sttserver.presentation;
