/**
 * Route and middleware registry, compilation, and dispatch.
 *
 * <pre>
 *   Router*  ─┐
 *   Route*    ├─ RouteCompiler ─→ DispatchTable ─→ Dispatcher
 *   Middleware*┘   (once, at bind)   (immutable)     (per message)
 * </pre>
 */
package com.questrail.bmux.route;
