/**
 * Persistent records and their status enums.
 */
package io.relay.model;
