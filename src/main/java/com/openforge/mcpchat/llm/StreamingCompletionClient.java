package com.openforge.mcpchat.llm;

import com.openforge.mcpchat.llm.model.Message;
import com.openforge.mcpchat.llm.model.Tool;

import java.util.List;

/**
 * Provider abstraction used by the chat loop: send a transcript plus the
 * tools selected for this turn, get back a pull-based stream of deltas.
 *
 * Implementations throw {@link LlmClient.LlmException} if the stream cannot
 * be opened; failures while reading surface from the returned stream.
 */
public interface StreamingCompletionClient {

    CompletionStream stream(List<Message> messages, List<Tool> tools);
}
