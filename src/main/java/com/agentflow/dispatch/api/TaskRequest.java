package com.agentflow.dispatch.api;

/**
 * Request body for POST /api/v1/tasks.
 *
 * @param title       required
 * @param description optional
 * @param priority    low, medium (default), high or urgent
 */
public record TaskRequest(String title, String description, String priority) {
}
