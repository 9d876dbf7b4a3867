/**
 * File System Adapter - OutputStore 구현체.
 *
 * <p>{@link com.ryuqq.imagebatch.adapter.filesystem.FileSystemOutputStore}는 출력 대상이
 * 이미 파일로 존재하는지 확인하여 skip-existing 동작을 지원합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
package com.ryuqq.imagebatch.adapter.filesystem;
