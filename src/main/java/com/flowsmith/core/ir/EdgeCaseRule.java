package com.flowsmith.core.ir;

import java.io.Serializable;

/**
 * @param condition no_rows_after_filter, empty_data_source, missing_required_field,
 *                  duplicate_records, rate_limit_exceeded or api_error
 * @param action    send_empty_result_message, skip_execution, use_default_value, retry or alert_admin
 */
public record EdgeCaseRule(String condition, String action, String message, String recipient) implements Serializable {}
