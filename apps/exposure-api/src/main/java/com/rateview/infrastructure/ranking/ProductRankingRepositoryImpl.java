package com.rateview.infrastructure.ranking;

import com.rateview.domain.ranking.ProductRanking;
import com.rateview.domain.ranking.ProductRankingRepository;
import com.rateview.domain.ranking.RankingCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * ProductRankingRepository의 JPA 구현체.
 *
 * @author Rateview
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class ProductRankingRepositoryImpl implements ProductRankingRepository {

    private final ProductRankingJpaRepository productRankingJpaRepository;

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<ProductRanking> findByProductId(Long productId) {
        return productRankingJpaRepository.findById(productId);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ProductRanking save(ProductRanking productRanking) {
        return productRankingJpaRepository.save(productRanking);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<ProductRanking> findTopByExposureScore(int limit) {
        return productRankingJpaRepository.findAllByOrderByExposureScoreDescProductIdAsc(PageRequest.of(0, limit));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<RankingCandidate> findTopCandidates(Long categoryId, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (categoryId == null) {
            return productRankingJpaRepository.findTopCandidates(page);
        }
        return productRankingJpaRepository.findTopCandidatesByCategoryId(categoryId, page);
    }
}
