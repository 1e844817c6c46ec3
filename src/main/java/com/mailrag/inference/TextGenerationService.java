package com.mailrag.inference;

import java.io.IOException;
import java.util.List;

public interface TextGenerationService {
    String generate(String systemContext, List<ChatMessage> history) throws IOException;
}
