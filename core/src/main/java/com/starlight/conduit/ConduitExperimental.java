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

import java.util.concurrent.atomic.AtomicBoolean;


/**
 * Gate for facilities which are unstable or only meant for testing. Using such a
 * facility without first calling {@link #acknowledge()} is a programming error.
 */
public final class ConduitExperimental {
	private static final AtomicBoolean ACKNOWLEDGED = new AtomicBoolean(
		Boolean.getBoolean( "conduit.experimental" ) );


	private ConduitExperimental() {}


	/**
	 * Opt in to experimental facilities for the rest of the process lifetime.
	 */
	public static void acknowledge() {
		ACKNOWLEDGED.set( true );
	}


	public static boolean isAcknowledged() {
		return ACKNOWLEDGED.get();
	}


	/**
	 * @throws IllegalStateException	If experimental facilities have not been
	 * 									acknowledged.
	 */
	static void check( String facility ) {
		if ( !ACKNOWLEDGED.get() ) {
			throw new IllegalStateException( facility + " is experimental and may only " +
				"be used after calling ConduitExperimental.acknowledge()" );
		}
	}
}
