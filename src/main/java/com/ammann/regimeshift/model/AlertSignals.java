/* (C)2026 */
package com.ammann.regimeshift.model;

/** Signal values submitted for alert evaluation. */
public record AlertSignals(double variance, double autocorrelation) {}
