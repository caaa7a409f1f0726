/**
 * 저장 문서 모델과 JSON 코덱.
 *
 * <p>문서 타입은 알 수 없는 필드를 {@link com.ryuqq.cutover.application.document.ExtensibleDocument}의
 * extras로 보존하므로, 이 버전이 모르는 필드도 read-modify-write 후 그대로 남습니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.application.document;
