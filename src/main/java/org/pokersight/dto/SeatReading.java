package org.pokersight.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Raw name/stack text read for one seat; either may be missing. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatReading {
    @Size(max = 64)
    private String name;
    @Size(max = 64)
    private String stack;
}
