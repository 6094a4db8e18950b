package com.telemetry.activity.core.model;

public enum SpanStatus { UNSET, OK, ERROR }
