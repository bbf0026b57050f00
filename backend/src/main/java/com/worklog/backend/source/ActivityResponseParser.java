package com.worklog.backend.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worklog.backend.snapshot.IssueEntry;
import com.worklog.backend.snapshot.VcsEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns activity tool payloads into typed entries. A payload is either a JSON array of entries
 * or an object of the form {@code {"error": "..."}}.
 */
@Component
public class ActivityResponseParser {

  private static final Logger log = LoggerFactory.getLogger(ActivityResponseParser.class);
  private static final int MAX_UNWRAP_DEPTH = 3;

  private final ObjectMapper objectMapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public List<IssueEntry> parseIssues(String payload) {
    return parseEntries(payload, IssueEntry.class, "Jira");
  }

  public List<VcsEntry> parseVcsEntries(String payload) {
    List<VcsEntry> entries = parseEntries(payload, VcsEntry.class, "GitHub");
    List<VcsEntry> typed = entries.stream().filter(entry -> entry.type() != null).toList();
    if (typed.size() != entries.size()) {
      log.debug("Ignored {} GitHub entries of unsupported type", entries.size() - typed.size());
    }
    return typed;
  }

  /**
   * Strips the MCP transport envelope from a tool result: a list of text contents, or a JSON
   * string literal holding the payload. Anything else is returned unchanged.
   */
  public String unwrap(String toolOutput) {
    String current = toolOutput;
    for (int depth = 0; depth < MAX_UNWRAP_DEPTH && StringUtils.hasText(current); depth++) {
      JsonNode node;
      try {
        node = objectMapper.readTree(current);
      } catch (JsonProcessingException ex) {
        return current;
      }
      if (node == null) {
        return current;
      }
      if (node.isTextual()) {
        current = node.asText();
      } else if (isTextContentList(node)) {
        current =
            StreamSupport.stream(node.spliterator(), false)
                .map(content -> content.path("text").asText())
                .collect(Collectors.joining());
      } else {
        return current;
      }
    }
    return current;
  }

  private boolean isTextContentList(JsonNode node) {
    if (!node.isArray() || node.isEmpty()) {
      return false;
    }
    for (JsonNode element : node) {
      if (!element.isObject()
          || !"text".equals(element.path("type").asText())
          || !element.path("text").isTextual()) {
        return false;
      }
    }
    return true;
  }

  private <T> List<T> parseEntries(String payload, Class<T> type, String sourceName) {
    if (!StringUtils.hasText(payload)) {
      throw new SourceFetchException(
          SourceFetchException.Kind.MALFORMED_RESPONSE,
          sourceName + " returned an empty response",
          payload);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new SourceFetchException(
          SourceFetchException.Kind.MALFORMED_RESPONSE,
          sourceName + " returned a non-JSON response",
          payload,
          ex);
    }
    if (root != null && root.isObject() && root.has("error")) {
      throw new SourceFetchException(
          SourceFetchException.Kind.UNAVAILABLE, root.path("error").asText(), payload);
    }
    if (root == null || !root.isArray()) {
      throw new SourceFetchException(
          SourceFetchException.Kind.MALFORMED_RESPONSE,
          sourceName + " response is not a list of entries",
          payload);
    }
    List<T> entries = new ArrayList<>(root.size());
    for (JsonNode element : root) {
      if (!element.isObject()) {
        throw new SourceFetchException(
            SourceFetchException.Kind.MALFORMED_RESPONSE,
            sourceName + " response contains a non-object entry",
            payload);
      }
      try {
        entries.add(objectMapper.treeToValue(element, type));
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        throw new SourceFetchException(
            SourceFetchException.Kind.MALFORMED_RESPONSE,
            sourceName + " entry could not be read: " + ex.getMessage(),
            payload,
            ex);
      }
    }
    return entries;
  }
}
