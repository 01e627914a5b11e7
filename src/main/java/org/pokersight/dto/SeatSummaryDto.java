package org.pokersight.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatSummaryDto {
    /** 1..N, by descending chips; eliminated players continue after the active ones */
    private int rank;
    private String position;
    private String name;
    private Long chips;
    private Double bbSize;
    private boolean active;
    /** Set for eliminated players only */
    private Integer finishingPlace;
}
