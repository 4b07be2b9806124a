package eu.virtualparadox.docassist.memory;

import java.util.Objects;

public record Turn(ESpeaker speaker, String utterance) {

    public Turn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(utterance, "utterance must not be null");
    }
}
