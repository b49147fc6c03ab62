package dev.linguaroute.repository;

import dev.linguaroute.entity.Post;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PostRepository extends ReactiveCrudRepository<Post, Long> {

    @Query("SELECT * FROM posts WHERE category_id = :categoryId ORDER BY published_at DESC, id DESC")
    Flux<Post> findByCategoryId(Long categoryId);

    Mono<Long> countByCategoryId(Long categoryId);
}
