package com.whenthen.app.assembler;

import com.whenthen.client.dto.data.PlayletDTO;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.PlayletAction;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PlayletAssembler {

    private PlayletAssembler() {
    }

    public static PlayletDTO toDTO(Playlet playlet) {
        return PlayletDTO.builder()
                .id(playlet.getId())
                .name(playlet.displayName())
                .enabled(playlet.isEnabled())
                .triggerType(playlet.triggerType().getCode())
                .actionTypes(playlet.getActions().stream()
                        .map(PlayletAction::getType)
                        .filter(Objects::nonNull)
                        .map(t -> t.getCode())
                        .collect(Collectors.toList()))
                .conditionCount(playlet.getConditions() != null ? playlet.getConditions().size() : 0)
                .createdAt(playlet.getCreatedAt())
                .build();
    }

    public static List<PlayletDTO> toDTOs(List<Playlet> playlets) {
        return playlets.stream().map(PlayletAssembler::toDTO).collect(Collectors.toList());
    }
}
