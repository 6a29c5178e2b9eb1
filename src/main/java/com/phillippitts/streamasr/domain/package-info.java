/**
 * Immutable domain values describing recognition sessions and their outcomes.
 */
package com.phillippitts.streamasr.domain;
