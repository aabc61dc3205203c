package com.polyhunter.bounty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * DTO for one page of earnings
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EarningPageDto {

    private List<EarningDto> earnings;
    private long total;
    private int page;
    private int pageSize;
}
