package com.example.dbmonitor.llm;

import java.util.function.Consumer;

/**
 * Text-generation collaborator used for suggestions and the interactive assistant.
 * Both methods throw {@link com.example.dbmonitor.exception.TextGenerationException} on failure.
 */
public interface TextGenerationClient {

    String generate(String systemInstruction, String userPrompt);

    /**
     * Stream the answer, handing each text chunk to {@code onChunk} as it arrives.
     * Returns once the answer is complete.
     */
    void stream(String systemInstruction, String userPrompt, Consumer<String> onChunk);
}
