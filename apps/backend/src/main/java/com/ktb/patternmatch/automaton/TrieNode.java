package com.ktb.patternmatch.automaton;

import java.util.*;

class TrieNode {
    final Map<Character, TrieNode> children = new HashMap<>();
    final int depth;
    boolean terminal;              // 이 노드에서 끝나는 패턴이 있는지
    TrieNode fail;                 // 실패 링크 (소유하지 않는 참조)
    List<String> outputs = new ArrayList<>();  // 이 상태에서 매칭으로 보고할 패턴들

    TrieNode(int depth) {
        this.depth = depth;
    }
}
