/**
 * Immutable data model: session input, summary output, backend parameters and asset catalog entries.
 */
package com.phillippitts.summarizer.domain;
