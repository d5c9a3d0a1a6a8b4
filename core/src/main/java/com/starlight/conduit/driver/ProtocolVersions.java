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

package com.starlight.conduit.driver;

import java.util.OptionalInt;


/**
 *
 */
public class ProtocolVersions {
	/**
	 * Protocol version history:
	 *  1 - Initial version. Thread count advertisement included.
	 */
	public static final byte PROTOCOL_VERSION = 1;

	public static final byte MIN_PROTOCOL_VERSION;
	static {
		int min_proto = Integer.getInteger( "conduit.min_supported_protocol", 1 );
		if ( min_proto < 1 || min_proto > PROTOCOL_VERSION ) {
			throw new IllegalArgumentException( "Invalid minimum supported protocol " +
				"specified via system property: " + min_proto );
		}
		MIN_PROTOCOL_VERSION = ( byte ) min_proto;
	}



	/**
	 * This will return the negotiated protocol version based of what the peer and this
	 * instance support.
	 *
	 * @param peer_min_version      Minimum version supported by the peer.
	 * @param peer_pref_version     Version preferred by the peer.
	 *
	 * @return      The negotiated version or empty if no suitable version was found.
	 */
	public static OptionalInt negotiateProtocolVersion( byte peer_min_version,
		byte peer_pref_version ) {

		return negotiateProtocolVersion( peer_min_version, peer_pref_version,
			MIN_PROTOCOL_VERSION, PROTOCOL_VERSION );
	}


	static OptionalInt negotiateProtocolVersion(
		byte peer_min_version, byte peer_pref_version,
		byte our_min_version, byte our_pref_version ) {

		// If they're preferred version is smaller than our minimum, then not compatible
		if ( peer_pref_version < our_min_version ||
			our_pref_version < peer_min_version ) {

			return OptionalInt.empty();
		}

		if ( our_pref_version < peer_pref_version ) {
			return OptionalInt.of( our_pref_version & 0xff );
		}
		else return OptionalInt.of( peer_pref_version & 0xff );
	}


	/**
	 * Indicates whether or not runtime thread count changes (ThreadCountIMessage) are
	 * supported in a given version.
	 */
	public static boolean supportsThreadCountUpdates( byte version ) {
		return version >= 1;
	}
}
