package com.flamingo.ai.docsorter.service.ai;

/**
 * A single chat completion request.
 *
 * @param model model identifier
 * @param systemPrompt system message
 * @param userPrompt user message
 * @param maxTokens output token limit
 * @param temperature sampling temperature
 */
public record ModelRequest(
    String model, String systemPrompt, String userPrompt, int maxTokens, double temperature) {}
