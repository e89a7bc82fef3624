/**
 * Immutable routing domain model: capabilities, candidates, requests, results and health snapshots.
 */
package com.phillippitts.providerrouter.domain;
