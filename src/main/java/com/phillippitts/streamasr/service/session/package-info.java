/**
 * Recognition session orchestration: the per-session state machine, its settings and the
 * {@link com.phillippitts.streamasr.service.session.StreamingRecognizer} entry point.
 */
package com.phillippitts.streamasr.service.session;
