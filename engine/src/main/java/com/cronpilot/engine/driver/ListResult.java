package com.cronpilot.engine.driver;

import java.util.List;

/** One page of a listing plus the total number of rows. */
public record ListResult<T>(List<T> items, long total, int offset, int limit) {}
