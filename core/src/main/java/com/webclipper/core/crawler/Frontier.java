package com.webclipper.core.crawler;

import com.webclipper.core.model.FrontierEntry;
import com.webclipper.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 실행 1회 전용 BFS 프런티어: FIFO 큐 + 방문 집합(정규화 키, 방문 순서 유지).
 * 같은 주소가 큐에 여러 번 들어갈 수 있지만 방문은 한 번뿐이다.
 */
final class Frontier {
    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<String> visited = new LinkedHashSet<>();

    void seed(String startAddress) {
        String fetch = UrlUtils.toFetchAddress(startAddress);
        queue.addLast(new FrontierEntry(UrlUtils.normalize(fetch), 0, fetch));
    }

    boolean isEmpty() { return queue.isEmpty(); }

    FrontierEntry next() { return queue.pollFirst(); }

    int queueLength() { return queue.size(); }

    boolean isVisited(String normalized) { return visited.contains(normalized); }

    /** @return 처음 방문이면 true */
    boolean markVisited(String normalized) { return visited.add(normalized); }

    /** 방문하지 않은 주소만 depth 로 큐에 넣는다. @return 실제로 넣었으면 true */
    boolean discover(String address, int depth) {
        String fetch = UrlUtils.toFetchAddress(address);
        String key = UrlUtils.normalize(fetch);
        if (visited.contains(key)) return false;
        queue.addLast(new FrontierEntry(key, depth, fetch));
        return true;
    }

    List<String> visitedAddresses() { return new ArrayList<>(visited); }
}
