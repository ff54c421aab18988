package dao.tron.anchor.repository;

import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.BatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnchorRepository extends JpaRepository<AnchorBatch, String> {

    List<AnchorBatch> findByStatusInOrderByFlushTimestampAsc(Collection<BatchStatus> statuses);

    Optional<AnchorBatch> findFirstByStatusInOrderByFlushTimestampDesc(Collection<BatchStatus> statuses);

    List<AnchorBatch> findAllByOrderByFlushTimestampAsc();
}
