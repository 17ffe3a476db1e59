package com.ktb.patternmatch.automaton;

import com.ktb.patternmatch.exception.AutomatonAlreadyBuiltException;
import com.ktb.patternmatch.exception.AutomatonNotBuiltException;
import com.ktb.patternmatch.exception.InvalidPatternException;
import java.util.*;
import lombok.extern.slf4j.Slf4j;

/**
 * HashMap 전이 기반 Aho-Corasick 오토마톤.
 */
@Slf4j
public class AhoCorasickMatcher implements PatternMatcher {

    private final TrieNode root;
    private final DuplicatePatternPolicy duplicatePolicy;
    private volatile boolean built;
    private int patternCount;
    private int nodeCount;

    public AhoCorasickMatcher() {
        this(DuplicatePatternPolicy.PRESERVE);
    }

    public AhoCorasickMatcher(DuplicatePatternPolicy duplicatePolicy) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.root = new TrieNode(0);
        this.root.fail = root;
        this.nodeCount = 1;
    }

    /** Trie 삽입 */
    @Override
    public void addPattern(String pattern) {
        if (built) {
            throw new AutomatonAlreadyBuiltException("addPattern");
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException(pattern, "빈 패턴은 등록할 수 없습니다.");
        }

        TrieNode node = root;
        for (char c : pattern.toCharArray()) {
            TrieNode parent = node;
            node = node.children.computeIfAbsent(c, k -> {
                nodeCount++;
                return new TrieNode(parent.depth + 1);
            });
        }

        if (node.terminal && duplicatePolicy == DuplicatePatternPolicy.IGNORE) {
            log.debug("중복 패턴 무시: '{}'", pattern);
            return;
        }
        node.terminal = true;
        node.outputs.add(pattern); // 이 노드에서 끝나는 패턴
        patternCount++;
    }

    /** 실패 링크 구성 (BFS) */
    @Override
    public void build() {
        if (built) {
            throw new AutomatonAlreadyBuiltException("build");
        }

        Queue<TrieNode> queue = new ArrayDeque<>();

        // root의 모든 자식 처리
        for (TrieNode child : root.children.values()) {
            child.fail = root;
            queue.add(child);
        }

        // BFS로 모든 노드 처리
        while (!queue.isEmpty()) {
            TrieNode current = queue.poll();

            for (Map.Entry<Character, TrieNode> entry : current.children.entrySet()) {
                char c = entry.getKey();
                TrieNode child = entry.getValue();
                queue.add(child);

                TrieNode failCandidate = current.fail;

                while (failCandidate != root && !failCandidate.children.containsKey(c)) {
                    failCandidate = failCandidate.fail;
                }

                child.fail = failCandidate.children.getOrDefault(c, root);

                if (!child.fail.outputs.isEmpty()) {
                    child.outputs.addAll(child.fail.outputs); // 실패 링크의 output 상속
                }
            }
        }

        built = true;
        log.debug("Aho-Corasick 빌드 완료 - patterns: {}, nodes: {}", patternCount, nodeCount);
    }

    @Override
    public List<String> match(String text) {
        ensureBuilt();
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> matches = new ArrayList<>();
        TrieNode node = root;

        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.charAt(i));
            if (!node.outputs.isEmpty()) {
                matches.addAll(node.outputs);
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
        TrieNode node = root;

        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.charAt(i));
            for (String pattern : node.outputs) {
                matches.add(PatternMatch.endingAt(pattern, i + 1));
            }
        }
        return matches;
    }

    /** 패턴 포함 여부 */
    @Override
    public boolean contains(String text) {
        ensureBuilt();
        if (text == null) {
            return false;
        }

        TrieNode node = root;
        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.charAt(i));
            if (!node.outputs.isEmpty()) {
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

    TrieNode root() {
        return root;
    }

    private TrieNode step(TrieNode node, char c) {
        while (node != root && !node.children.containsKey(c)) {
            node = node.fail;
        }
        return node.children.getOrDefault(c, root);
    }

    private void ensureBuilt() {
        if (!built) {
            throw new AutomatonNotBuiltException();
        }
    }
}
