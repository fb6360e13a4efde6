package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.testsupport.IntegrationTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryConcurrencyTest extends IntegrationTestSupport {

    private static final int THREADS = 8;
    private static final int ROUNDS = 20;

    @Autowired CategoryService categoryService;

    private final ExecutorService executor = Executors.newFixedThreadPool(THREADS);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("simultaneous addCategory calls with one new name all return the single stored id")
    void concurrentAddCategoryReturnsOneId() {
        for (int round = 0; round < ROUNDS; round++) {
            String name = "Cat" + round;

            List<CompletableFuture<Long>> tasks = IntStream.range(0, THREADS)
                    .mapToObj(i -> CompletableFuture.supplyAsync(() -> categoryService.addCategory(name), executor))
                    .toList();
            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

            List<Long> ids = tasks.stream().map(CompletableFuture::join).toList();
            assertThat(ids).doesNotContainNull();
            assertThat(ids).containsOnly(ids.get(0));
            assertThat(countRows("SELECT COUNT(*) FROM categories WHERE name = ?", name)).isEqualTo(1);
        }

        assertThat(categoryService.listCategories()).hasSize(ROUNDS);
    }
}
