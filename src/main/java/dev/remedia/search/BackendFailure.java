package dev.remedia.search;

/**
 * A backend call that did not produce a rank list. Captured by the dispatcher instead of thrown.
 *
 * @param query the query the call was made for
 * @param backend the failing backend (embedding failures count as {@link Backend#VECTOR})
 * @param message cause description
 */
public record BackendFailure(String query, Backend backend, String message) {}
