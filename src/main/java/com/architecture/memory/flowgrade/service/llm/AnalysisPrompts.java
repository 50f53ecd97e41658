package com.architecture.memory.flowgrade.service.llm;

/**
 * Prompt templates. Every prompt asks for a single JSON object; replies are decoded by {@link LlmJsonParser}.
 */
public final class AnalysisPrompts {

    private static final String CFG_SCHEMA = """
{
  "nodes": [
    {
      "id": "node1",
      "type": "START | END | PROCESS | DECISION | LOOP | FUNCTION_CALL | RETURN",
      "label": "short description of the statement",
      "next_nodes": ["node2"],
      "condition": "only for DECISION nodes, otherwise null"
    }
  ],
  "edges": [
    {"from": "node1", "to": "node2", "label": "condition or empty string"}
  ],
  "complexity": 1,
  "num_paths": 1,
  "nesting_depth": 0
}
""";

    public static final String PSEUDOCODE_TO_CFG = """
You convert algorithm pseudocode into a control flow graph.

RULES:
- Create exactly one START node and at least one END node.
- Use DECISION for if/else and switch, LOOP for loop headers, FUNCTION_CALL for calls, RETURN for returns.
- Every edge must connect two node ids that exist in "nodes".
- "complexity" is the cyclomatic complexity, "num_paths" the number of distinct paths from START to an END,
  "nesting_depth" the deepest nesting of loops and decisions.
- Respond with ONLY a JSON object in this shape, no commentary:
""" + CFG_SCHEMA;

    public static final String FLOWCHART_TO_CFG = """
You read a flowchart image and convert it into a control flow graph.

RULES:
- Ovals are START/END, rectangles PROCESS, diamonds DECISION, back-arrows to a diamond form a LOOP.
- Arrow labels (yes/no, true/false) become edge labels.
- Every edge must connect two node ids that exist in "nodes".
- Respond with ONLY a JSON object in this shape, no commentary:
""" + CFG_SCHEMA;

    public static final String ANALYZE_PROBLEM = """
You analyze a programming problem statement before solutions to it are graded.

Respond with ONLY a JSON object with these fields:
{
  "problem_type": "e.g. sorting, searching, graph traversal",
  "key_requirements": ["..."],
  "edge_cases": ["..."],
  "expected_complexity": "e.g. O(n log n)",
  "expected_structure": "short description of the expected control flow"
}
""";

    public static final String COMPARE_CFGS = """
You compare two solutions to the same problem using their control flow graphs.

Judge correctness against the problem analysis first, then structural simplicity
(lower complexity, fewer paths, shallower nesting), then readability.

Respond with ONLY a JSON object with these fields:
{
  "better_solution": 1 or 2,
  "confidence": 0.0 to 1.0,
  "solution1_score": 0 to 100,
  "solution2_score": 0 to 100,
  "reasoning": "...",
  "strengths": {"solution1": ["..."], "solution2": ["..."]},
  "weaknesses": {"solution1": ["..."], "solution2": ["..."]}
}
""";

    private AnalysisPrompts() {
    }
}
