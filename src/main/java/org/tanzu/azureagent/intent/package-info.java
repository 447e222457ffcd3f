/**
 * Query classification and dispatch: an ordered ladder of keyword, regex and alias matchers with a
 * fuzzy fallback against the live resource-type catalog, plus Markdown rendering of the results.
 */
package org.tanzu.azureagent.intent;
