package com.autonomous.approval.model;

import com.slack.api.model.block.LayoutBlock;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlackMessage {
    // Fallback text, also what notifications and screen readers show.
    private String text;

    @Builder.Default
    private List<LayoutBlock> blocks = new ArrayList<>();
}
