/**
 * Caching fingerprint: code identity of a step and of its output materializers.
 */
package com.stepflow.caching;
