package org.astbridge.gc;

import org.astbridge.ast.AbstractNode;

/**
 * 节点被 AstGarbageCollector 释放时收到通知。
 */
@FunctionalInterface
public interface NodeReleaseListener {

    void onRelease(AbstractNode node);
}
