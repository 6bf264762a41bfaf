package com.yunhwan.catalog.usecase.loader;

import java.util.List;
import java.util.Map;

/**
 * 여러 키를 한 번에 조회하는 백엔드 호출.
 * 없는 키는 결과 map에 넣지 않으면 된다.
 */
@FunctionalInterface
public interface BatchFetcher<K, V> {

    Map<K, V> fetch(List<K> keys);
}
