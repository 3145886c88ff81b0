package com.whenthen.client.dto.cmd;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReassignTaskCmd {

    @NotBlank
    private String playletId;
}
