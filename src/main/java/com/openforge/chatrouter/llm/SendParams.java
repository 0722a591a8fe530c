package com.openforge.chatrouter.llm;

/** Sampling parameters passed to every provider. */
public record SendParams(double temperature, int maxTokens) {

    public static SendParams from(LlmProperties props) {
        return new SendParams(props.temperature(), props.maxTokens());
    }
}
