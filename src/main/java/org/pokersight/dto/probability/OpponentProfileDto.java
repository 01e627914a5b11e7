package org.pokersight.dto.probability;

import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OpponentProfileDto {
    private int sampleSize;
    private double averageScore;
    /** Category label -> number of sampled opponent hands making it */
    private Map<String, Integer> categories;
}
