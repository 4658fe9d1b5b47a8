/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.LocalDate;

/** Number of detections of one species on one calendar day. */
public record DailyCount(LocalDate day, long count) {}
