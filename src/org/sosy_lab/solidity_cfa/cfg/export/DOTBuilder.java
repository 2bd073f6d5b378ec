// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg.export;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.solidity_cfa.ast.AstNode;
import org.sosy_lab.solidity_cfa.cfg.CFGNode;
import org.sosy_lab.solidity_cfa.cfg.ControlFlowBlock;
import org.sosy_lab.solidity_cfa.cfg.ControlFlowGraph;
import org.sosy_lab.solidity_cfa.cfg.FunctionFlow;
import org.sosy_lab.solidity_cfa.cfg.ModifierFlow;
import org.sosy_lab.solidity_cfa.cfg.PlaceholderCut;

/** Writes the CFGs of functions and modifiers in the DOT format of Graphviz. */
public final class DOTBuilder {

  private static final Joiner LINE_JOINER = Joiner.on("\\l");

  private DOTBuilder() {}

  /** Write one file per function and modifier into the given directory. */
  public static void dump(ControlFlowGraph pGraph, Path pDir, LogManager pLogger) {
    List<FunctionFlow> flows = new ArrayList<>(pGraph.getFunctionFlows().values());
    flows.addAll(pGraph.getModifierFlows().values());

    for (FunctionFlow flow : flows) {
      Path dotFile = pDir.resolve("cfg__" + flow.getName() + "__" + flow.getEntry() + ".dot");

      try {
        MoreFiles.createParentDirectories(dotFile);
      } catch (IOException e) {
        pLogger.logUserException(
            Level.WARNING, e, "Could not create parent directories to write CFG to dot file");
        return;
      }

      try (Writer w = Files.newBufferedWriter(dotFile, StandardCharsets.UTF_8)) {
        generateDOT(w, pGraph, flow);
      } catch (IOException e) {
        pLogger.logUserException(Level.WARNING, e, "Could not write CFG to dot file");
        // ignore exception and continue with the next subprogram
      }
    }
  }

  /**
   * Write all nodes of the given flow, including unreachable ones, with their blocks as labels.
   * Edges into the exception node are dashed, the gaps at placeholders are dotted.
   */
  public static void generateDOT(Appendable pApp, ControlFlowGraph pGraph, FunctionFlow pFlow)
      throws IOException {
    pApp.append("digraph \"" + escapeGraphvizLabel(pFlow.getName(), " ") + "\" {\n");
    pApp.append("node [shape=\"box\"]\n");

    List<CFGNode> nodes = pGraph.nodesOf(pFlow.getDefinition());
    ImmutableMap<CFGNode, String> anchorShapes =
        ImmutableMap.of(
            pFlow.getEntry(), "invhouse",
            pFlow.getExit(), "house",
            pFlow.getException(), "octagon");
    for (CFGNode node : nodes) {
      pApp.append(formatNode(node, anchorShapes.get(node)));
    }

    for (CFGNode node : nodes) {
      for (CFGNode successor : node.getExits()) {
        pApp.append(formatEdge(node, successor, successor == pFlow.getException()));
      }
    }

    if (pFlow instanceof ModifierFlow) {
      for (PlaceholderCut cut : ((ModifierFlow) pFlow).getPlaceholders()) {
        pApp.append(
            cut.getNodeBefore().getNodeNumber()
                + " -> "
                + cut.getNodeAfter().getNodeNumber()
                + " [label=\"_\" style=\"dotted\" arrowhead=\"empty\"]\n");
      }
    }

    pApp.append("}\n");
  }

  private static String formatNode(CFGNode pNode, @Nullable String pShape) {
    ControlFlowBlock block = pNode.getBlock();
    List<String> lines = new ArrayList<>();
    lines.add(pNode.toString());
    FluentIterable.from(block.getVariableDeclarations())
        .transform(AstNode::toASTString)
        .copyInto(lines);
    FluentIterable.from(block.getExpressions()).transform(AstNode::toASTString).copyInto(lines);
    if (!block.getInlineAssemblyStatements().isEmpty()) {
      lines.add("assembly");
    }
    if (block.getReturnStatement().isPresent()) {
      lines.add(block.getReturnStatement().orElseThrow().toASTString());
    }

    StringBuilder sb = new StringBuilder();
    sb.append(pNode.getNodeNumber());
    sb.append(" [");
    if (pShape != null) {
      sb.append("shape=\"").append(pShape).append("\" ");
    }
    sb.append("label=\"");
    sb.append(
        LINE_JOINER.join(FluentIterable.from(lines).transform(l -> escapeGraphvizLabel(l, " "))));
    sb.append("\\l\"]\n");
    return sb.toString();
  }

  private static String formatEdge(CFGNode pFrom, CFGNode pTo, boolean pIntoException) {
    StringBuilder sb = new StringBuilder();
    sb.append(pFrom.getNodeNumber());
    sb.append(" -> ");
    sb.append(pTo.getNodeNumber());
    if (pIntoException) {
      sb.append(" [style=\"dashed\" color=\"red\"]");
    }
    sb.append("\n");
    return sb.toString();
  }

  /** Escape a string so that it can be used inside a quoted Graphviz label. */
  public static String escapeGraphvizLabel(String input, String newlineReplacement) {
    return input
        .replace("\\", "\\\\")
        .replace("\"", "\\\"")
        .replace("\n", newlineReplacement);
  }
}
