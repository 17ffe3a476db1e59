package com.ktb.patternmatch.automaton;

import com.ktb.patternmatch.exception.AutomatonAlreadyBuiltException;
import com.ktb.patternmatch.exception.AutomatonNotBuiltException;
import com.ktb.patternmatch.exception.InvalidPatternException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * 0x00-0xFF 고정 알파벳용 Aho-Corasick 오토마톤.
 * <p>
 * 노드는 정수 인덱스로 다루며, 노드 {@code n}의 기호 {@code s} 전이는
 * {@code jumpTable[(n << BITS_PER_SYMBOL) | s]} 에 있다. build 단계에서 모든 (상태, 기호) 쌍의
 * goto 값을 미리 채우므로 매칭 루프에서 실패 링크를 따라가지 않는다.
 * 패턴에 알파벳 밖의 문자가 있으면 등록을 거부하고, 텍스트의 알파벳 밖 문자는 root 로 되돌린다.
 */
@Slf4j
public class ArrayTableMatcher implements PatternMatcher {

    static final int BITS_PER_SYMBOL = 8;
    static final int ALPHABET_SIZE = 1 << BITS_PER_SYMBOL;
    static final int MAX_SYMBOL = ALPHABET_SIZE - 1;

    private static final int ROOT = 0;
    private static final int INITIAL_CAPACITY = 16;

    private final DuplicatePatternPolicy duplicatePolicy;

    // root 는 어느 노드의 자식도 아니므로 build 전 jumpTable 의 0 은 "전이 없음"을 뜻한다
    private int[] jumpTable;
    private int[] failLinks;
    private int[] depths;
    private boolean[] terminal;
    private final List<List<String>> outputs = new ArrayList<>();

    private int nodeCount;
    private int patternCount;
    private volatile boolean built;

    public ArrayTableMatcher() {
        this(DuplicatePatternPolicy.PRESERVE);
    }

    public ArrayTableMatcher(DuplicatePatternPolicy duplicatePolicy) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.jumpTable = new int[INITIAL_CAPACITY << BITS_PER_SYMBOL];
        this.failLinks = new int[INITIAL_CAPACITY];
        this.depths = new int[INITIAL_CAPACITY];
        this.terminal = new boolean[INITIAL_CAPACITY];
        newNode(0);
    }

    @Override
    public void addPattern(String pattern) {
        if (built) {
            throw new AutomatonAlreadyBuiltException("addPattern");
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException(pattern, "빈 패턴은 등록할 수 없습니다.");
        }
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) > MAX_SYMBOL) {
                throw new InvalidPatternException(pattern,
                        "패턴에 지원하지 않는 문자가 있습니다 (index " + i + ", 허용 범위 0x00-0xFF).");
            }
        }

        int node = ROOT;
        for (int i = 0; i < pattern.length(); i++) {
            int index = (node << BITS_PER_SYMBOL) | pattern.charAt(i);
            int next = jumpTable[index];
            if (next == ROOT) {
                next = newNode(depths[node] + 1);
                jumpTable[index] = next;
            }
            node = next;
        }

        if (terminal[node] && duplicatePolicy == DuplicatePatternPolicy.IGNORE) {
            log.debug("중복 패턴 무시: '{}'", pattern);
            return;
        }
        terminal[node] = true;
        outputs.get(node).add(pattern);
        patternCount++;
    }

    @Override
    public void build() {
        if (built) {
            throw new AutomatonAlreadyBuiltException("build");
        }

        // BFS 방문 순서가 곧 큐. 각 노드는 한 번씩만 들어간다
        int[] queue = new int[nodeCount];
        int head = 0;
        int tail = 0;

        for (int s = 0; s < ALPHABET_SIZE; s++) {
            int child = jumpTable[s];
            if (child != ROOT) {
                failLinks[child] = ROOT;
                queue[tail++] = child;
            }
        }

        while (head < tail) {
            int node = queue[head++];
            int row = node << BITS_PER_SYMBOL;
            // fail 노드는 더 얕으므로 이미 goto 행이 완성되어 있다
            int failRow = failLinks[node] << BITS_PER_SYMBOL;

            for (int s = 0; s < ALPHABET_SIZE; s++) {
                int child = jumpTable[row | s];
                if (child == ROOT) {
                    jumpTable[row | s] = jumpTable[failRow | s];
                    continue;
                }
                int fail = jumpTable[failRow | s];
                failLinks[child] = fail;
                if (!outputs.get(fail).isEmpty()) {
                    outputs.get(child).addAll(outputs.get(fail));
                }
                queue[tail++] = child;
            }
        }

        for (int i = 0; i < nodeCount; i++) {
            outputs.set(i, List.copyOf(outputs.get(i)));
        }
        built = true;
        log.debug("Aho-Corasick(array) 빌드 완료 - patterns: {}, nodes: {}, table: {} entries",
                patternCount, nodeCount, nodeCount << BITS_PER_SYMBOL);
    }

    @Override
    public List<String> match(String text) {
        ensureBuilt();
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> matches = new ArrayList<>();
        int state = ROOT;
        for (int i = 0; i < text.length(); i++) {
            state = step(state, text.charAt(i));
            List<String> found = outputs.get(state);
            if (!found.isEmpty()) {
                matches.addAll(found);
            }
        }
        return matches;
    }

    @Override
    public List<PatternMatch> matchWithPositions(String text) {
        ensureBuilt();
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<PatternMatch> matches = new ArrayList<>();
        int state = ROOT;
        for (int i = 0; i < text.length(); i++) {
            state = step(state, text.charAt(i));
            for (String pattern : outputs.get(state)) {
                matches.add(PatternMatch.endingAt(pattern, i + 1));
            }
        }
        return matches;
    }

    @Override
    public boolean contains(String text) {
        ensureBuilt();
        if (text == null) {
            return false;
        }

        int state = ROOT;
        for (int i = 0; i < text.length(); i++) {
            state = step(state, text.charAt(i));
            if (!outputs.get(state).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isBuilt() {
        return built;
    }

    @Override
    public int patternCount() {
        return patternCount;
    }

    int nodeCount() {
        return nodeCount;
    }

    int failLink(int node) {
        return failLinks[node];
    }

    int depth(int node) {
        return depths[node];
    }

    List<String> outputsOf(int node) {
        return outputs.get(node);
    }

    private int step(int state, char c) {
        if (c > MAX_SYMBOL) {
            return ROOT;
        }
        return jumpTable[(state << BITS_PER_SYMBOL) | c];
    }

    private int newNode(int depth) {
        if (nodeCount == depths.length) {
            int capacity = depths.length << 1;
            jumpTable = Arrays.copyOf(jumpTable, capacity << BITS_PER_SYMBOL);
            failLinks = Arrays.copyOf(failLinks, capacity);
            depths = Arrays.copyOf(depths, capacity);
            terminal = Arrays.copyOf(terminal, capacity);
        }
        int node = nodeCount++;
        depths[node] = depth;
        outputs.add(new ArrayList<>());
        return node;
    }

    private void ensureBuilt() {
        if (!built) {
            throw new AutomatonNotBuiltException();
        }
    }
}
