package com.example.medialibrary.repository;

import com.example.medialibrary.entity.MediaRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MediaRecordRepository extends JpaRepository<MediaRecordEntity, Long> {

    Optional<MediaRecordEntity> findBySourceUrl(String sourceUrl);

    Optional<MediaRecordEntity> findByPlatformAndSourceId(String platform, String sourceId);

    Optional<MediaRecordEntity> findFirstByContentHash(String contentHash);

    boolean existsBySourceUrl(String sourceUrl);

    boolean existsByContentHash(String contentHash);

    List<MediaRecordEntity> findAllByOrderByIngestedAtDescIdDesc(Pageable pageable);

    List<MediaRecordEntity> findByPlatformOrderByIngestedAtDescIdDesc(String platform, Pageable pageable);

    List<MediaRecordEntity> findByCollectionOrderByIngestedAtDescIdDesc(String collection, Pageable pageable);

    @Query("select m from MediaRecordEntity m where m.uploader = :uploader or m.uploaderId = :uploader "
            + "order by m.ingestedAt desc, m.id desc")
    List<MediaRecordEntity> findByUploaderOrUploaderId(@Param("uploader") String uploader, Pageable pageable);

    /**
     * Full-text match against the FTS5 index. {@code matchExpression} must already be a valid FTS5
     * expression; bm25 rank ascending is best first.
     */
    @Query(value = "SELECT m.* FROM media_records_fts "
            + "JOIN media_records m ON m.id = media_records_fts.rowid "
            + "WHERE media_records_fts MATCH :matchExpression "
            + "ORDER BY media_records_fts.rank, m.ingested_at DESC, m.id DESC "
            + "LIMIT :limit",
            nativeQuery = true)
    List<MediaRecordEntity> search(@Param("matchExpression") String matchExpression, @Param("limit") int limit);

    @Modifying
    @Query("delete from MediaRecordEntity m where m.id = :id")
    int deleteRecordById(@Param("id") Long id);

    @Query("select coalesce(sum(m.fileSizeBytes), 0L) from MediaRecordEntity m")
    long sumFileSizeBytes();

    @Query("select m.platform as name, count(m) as total from MediaRecordEntity m "
            + "group by m.platform order by count(m) desc")
    List<NamedCount> countByPlatform();

    @Query("select m.uploader as name, count(m) as total from MediaRecordEntity m "
            + "group by m.uploader order by count(m) desc")
    List<NamedCount> countByUploader();

    interface NamedCount {
        String getName();

        long getTotal();
    }
}
