package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.exception.ResponseGenerationException;
import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.ResponderInput;

/**
 * Produces a draft answer for one intent.
 * <p>
 * Implementations may only cite chunks that are part of {@link ResponderInput#context()}.
 */
public interface PortfolioResponder {

    Intent intent();

    /**
     * @return non-empty draft text
     * @throws ResponseGenerationException when no text could be produced
     */
    DraftResponse respond(ResponderInput input);
}
