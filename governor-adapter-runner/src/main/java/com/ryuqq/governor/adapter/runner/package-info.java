/**
 * Runtime implementations: the request coordinator, the adaptive lifecycle scheduler, the
 * cache janitor and the {@link com.ryuqq.governor.adapter.runner.Governor} that wires them.
 */
package com.ryuqq.governor.adapter.runner;
