// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import javax.annotation.Nonnull;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;


/**
 * Allows access to context information when inside a call received from a peer.
 */
public class ConduitContext {
	private static final ThreadLocal<CallInfo> CALL_INFO = new ThreadLocal<>();


	// Hidden constructor
	private ConduitContext() {}


	/**
	 * Returns true if the current thread is currently handling a call from a peer.
	 */
	public static boolean isCall() {
		return CALL_INFO.get() != null;
	}


	/**
	 * Returns the session the current call arrived on, or null if not in a call.
	 */
	public static ConduitSession getSession() {
		CallInfo info = CALL_INFO.get();
		return info == null
			? null
			: info.session;
	}


	/**
	 * Returns the server which accepted the session the current call arrived on, or
	 * null if not in a call or the call arrived on a client session.
	 */
	public static ConduitServer getServer() {
		CallInfo info = CALL_INFO.get();
		return info == null
			? null
			: info.session.getServer();
	}


	/**
	 * Returns true if the current call is one-way.
	 */
	public static boolean isOneway() {
		CallInfo info = CALL_INFO.get();
		return info != null && info.oneway;
	}


	/**
	 * Run a task after the current call has returned. The task runs on a bounded pool
	 * owned by the session the call arrived on and is cancelled if the session shuts
	 * down before it starts.
	 *
	 * @throws IllegalStateException	If not in a call.
	 */
	public static ScheduledFuture<?> runLater( @Nonnull Runnable task, long delay,
		@Nonnull TimeUnit unit ) {

		CallInfo info = CALL_INFO.get();
		if ( info == null ) {
			throw new IllegalStateException( "Not inside a call" );
		}
		return info.session.scheduleDetached( task, delay, unit );
	}


	/**
	 * @return		The previous call info, to be passed to {@link #restoreCallInfo}.
	 */
	static Object setCallInfo( @Nonnull ConduitSession session, boolean oneway ) {
		CallInfo previous = CALL_INFO.get();
		CALL_INFO.set( new CallInfo( session, oneway ) );
		return previous;
	}

	static void restoreCallInfo( Object previous ) {
		if ( previous == null ) CALL_INFO.remove();
		else CALL_INFO.set( ( CallInfo ) previous );
	}


	private static class CallInfo {
		final ConduitSession session;
		final boolean oneway;

		CallInfo( ConduitSession session, boolean oneway ) {
			this.session = session;
			this.oneway = oneway;
		}
	}
}
