package com.chainaudit.analysis.chain;

import com.chainaudit.parser.ts.SyntaxNode;
import com.chainaudit.parser.ts.SyntaxNode.Call;

import java.util.List;

/**
 * 方法链中的一环：receiver.method(arguments)
 *
 * @param receiver  方法的接收者表达式
 * @param method    方法名
 * @param arguments 实参
 * @param call      该环对应的调用节点
 */
public record ChainSegment(SyntaxNode receiver, String method, List<SyntaxNode> arguments, Call call) {
}
