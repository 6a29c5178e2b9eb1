/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/recognitions} - recognize a recording of base64 Opus packets</li>
 * </ul>
 *
 * @see com.phillippitts.streamasr.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.streamasr.presentation.controller;
