package com.ryuqq.cutover.migration.checkpoint;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Checkpoint 저장소.
 *
 * <p>여러 worker가 동시에 완료를 기록하므로 {@link #update(Checkpoint, UnaryOperator)}는
 * 단일 writer로 직렬화되어야 하며, 저장은 원자적이어야 합니다 (중간에 중단되어도
 * 이전 상태 또는 새 상태 중 하나만 남음).</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * 저장된 체크포인트 읽기.
     *
     * @return 체크포인트 (없으면 empty)
     * @throws CheckpointException 읽기 실패 또는 형식 오류 시
     */
    Optional<Checkpoint> load();

    /**
     * 체크포인트 저장 (전체 교체).
     *
     * @throws CheckpointException 쓰기 실패 시
     */
    void save(Checkpoint checkpoint);

    /**
     * read-modify-write를 직렬화하여 실행.
     *
     * @param initial 저장된 체크포인트가 없을 때 사용할 값
     * @param change 변경 함수
     * @return 저장된 새 체크포인트
     * @throws CheckpointException 읽기/쓰기 실패 시
     */
    Checkpoint update(Checkpoint initial, UnaryOperator<Checkpoint> change);
}
