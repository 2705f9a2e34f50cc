package com.fleethunt.store;

import com.fleethunt.model.AttributeValue;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Versioned key/value store keyed by (subject, attribute). {@link #append} adds to a log,
 * {@link #set} replaces the whole log with a single value.
 */
public interface AttributeStore {

  String DEFINITION = "definition";
  String STATE = "state";
  String CLIENTS = "clients";
  String FINISHED = "finished";
  String BADNESS = "badness";
  String ERRORS = "errors";
  String LOG = "log";
  String RESOURCES = "resources";

  boolean exists(String subject);

  List<String> subjects();

  void set(String subject, String attribute, Object value);

  void append(String subject, String attribute, Object value);

  /** All recorded values, oldest first. */
  <T> List<AttributeValue<T>> history(String subject, String attribute, Class<T> type);

  default <T> Optional<T> latest(String subject, String attribute, Class<T> type) {
    List<AttributeValue<T>> values = history(subject, attribute, type);
    if (values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(values.size() - 1).value());
  }

  default <T> Set<T> distinctValues(String subject, String attribute, Class<T> type) {
    Set<T> result = new LinkedHashSet<>();
    for (AttributeValue<T> value : history(subject, attribute, type)) {
      result.add(value.value());
    }
    return result;
  }
}
