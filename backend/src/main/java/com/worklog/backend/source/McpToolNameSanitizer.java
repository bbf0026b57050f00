package com.worklog.backend.source;

import org.springframework.util.StringUtils;

/** Normalises tool names the same way the MCP client does before registering callbacks. */
public final class McpToolNameSanitizer {

  private McpToolNameSanitizer() {}

  public static String sanitize(String name) {
    if (!StringUtils.hasText(name)) {
      return null;
    }
    String trimmed = name.trim();
    String sanitized =
        trimmed.replaceAll(
            "[^\\p{IsHan}\\p{InCJK_Unified_Ideographs}\\p{InCJK_Compatibility_Ideographs}a-zA-Z0-9_-]",
            "");
    sanitized = sanitized.replace('-', '_');
    return StringUtils.hasText(sanitized) ? sanitized : null;
  }
}
