package com.jdc.recipe_manager.domain.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatsDto {

    private long totalUsers;
    private long totalRecipes;
    private long totalCategories;
    private long totalViews;
    private long recentEvents;
    private long recentRecipes;

    @Builder.Default
    private List<TopUserDto> topUsers = new ArrayList<>();

    public static SystemStatsDto empty() {
        return SystemStatsDto.builder().build();
    }
}
