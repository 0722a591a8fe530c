package com.openforge.chatrouter.llm;

/** Wire protocol spoken by a provider; selects the {@link ProviderAdapter} variant. */
public enum ProviderType {
    /** OpenAI-style {@code /chat/completions}: Groq, Cerebras, Mistral, OpenRouter, DeepSeek, OpenAI. */
    OPENAI,
    /** Google Gemini {@code models/{model}:generateContent}. */
    GEMINI
}
