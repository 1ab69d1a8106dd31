package com.rateview.infrastructure.ranking;

import com.rateview.domain.ranking.ProductRanking;
import com.rateview.domain.ranking.RankingCandidate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * ProductRanking JPA Repository.
 * <p>
 * 정렬은 항상 exposure_score 내림차순, product_id 오름차순입니다. 동점 순서가 고정되어야 노출 구성이 결정적입니다.
 * </p>
 */
public interface ProductRankingJpaRepository extends JpaRepository<ProductRanking, Long> {

    List<ProductRanking> findAllByOrderByExposureScoreDescProductIdAsc(Pageable pageable);

    @Query("SELECT new com.rateview.domain.ranking.RankingCandidate(r, p.categoryId) "
        + "FROM ProductRanking r, Product p "
        + "WHERE p.id = r.productId AND p.deletedAt IS NULL "
        + "ORDER BY r.exposureScore DESC, r.productId ASC")
    List<RankingCandidate> findTopCandidates(Pageable pageable);

    @Query("SELECT new com.rateview.domain.ranking.RankingCandidate(r, p.categoryId) "
        + "FROM ProductRanking r, Product p "
        + "WHERE p.id = r.productId AND p.deletedAt IS NULL AND p.categoryId = :categoryId "
        + "ORDER BY r.exposureScore DESC, r.productId ASC")
    List<RankingCandidate> findTopCandidatesByCategoryId(@Param("categoryId") Long categoryId, Pageable pageable);
}
