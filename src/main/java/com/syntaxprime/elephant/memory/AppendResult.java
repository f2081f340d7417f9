package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.model.ConversationMessage;

public record AppendResult(ConversationMessage message, boolean retitled) {
}
