/**
 * Apache Flink job hosting the API Sentinel analysis engine.
 *
 * <p>
 * {@link com.apisentinel.flink.ApiSentinelJob} wires Kafka metric samples into
 * {@link com.apisentinel.flink.AnalysisProcessFunction} and writes engine
 * records and notification intents back to Kafka.
 * </p>
 */
package com.apisentinel.flink;
