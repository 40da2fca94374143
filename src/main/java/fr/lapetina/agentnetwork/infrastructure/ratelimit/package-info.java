/**
 * Token bucket rate limiting and retry with exponential backoff, one bucket per endpoint.
 */
package fr.lapetina.agentnetwork.infrastructure.ratelimit;
