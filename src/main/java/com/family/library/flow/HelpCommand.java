package com.family.library.flow;

import com.family.library.dto.InboundEvent;
import com.family.library.dto.OutboundMessage;
import com.family.library.service.ResponsePhrases;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class HelpCommand implements CommandHandler {

    private final ResponsePhrases phrases;

    @Override
    public List<String> tokens() {
        return List.of("start", "help");
    }

    @Override
    public StepOutcome start(InboundEvent event) {
        return StepOutcome.noDialog(OutboundMessage.text(event.getContext(), phrases.welcome()));
    }
}
