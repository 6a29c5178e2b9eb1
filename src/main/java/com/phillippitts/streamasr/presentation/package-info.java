/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Depends on the service layer; nothing in the service layer depends on it.
 */
package com.phillippitts.streamasr.presentation;
