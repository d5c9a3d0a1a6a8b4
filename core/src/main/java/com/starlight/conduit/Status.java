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

/**
 * Status codes returned by transactions. Any value not defined here is an application
 * status and is passed between peers unchanged.
 */
public final class Status {
	public static final int OK = 0;

	public static final int UNKNOWN_ERROR = Integer.MIN_VALUE;
	public static final int BAD_TYPE = UNKNOWN_ERROR + 1;
	public static final int BAD_VERSION = UNKNOWN_ERROR + 2;
	public static final int UNEXPECTED_NULL = UNKNOWN_ERROR + 8;

	public static final int BAD_VALUE = -22;
	public static final int WOULD_BLOCK = -11;
	public static final int DEAD_OBJECT = -32;
	public static final int INVALID_OPERATION = -38;
	public static final int UNKNOWN_TRANSACTION = -74;


	private Status() {}


	public static boolean isOk( int status ) {
		return status == OK;
	}


	public static String toString( int status ) {
		switch( status ) {
			case OK:
				return "OK";
			case UNKNOWN_ERROR:
				return "UNKNOWN_ERROR";
			case BAD_TYPE:
				return "BAD_TYPE";
			case BAD_VERSION:
				return "BAD_VERSION";
			case UNEXPECTED_NULL:
				return "UNEXPECTED_NULL";
			case BAD_VALUE:
				return "BAD_VALUE";
			case WOULD_BLOCK:
				return "WOULD_BLOCK";
			case DEAD_OBJECT:
				return "DEAD_OBJECT";
			case INVALID_OPERATION:
				return "INVALID_OPERATION";
			case UNKNOWN_TRANSACTION:
				return "UNKNOWN_TRANSACTION";
			default:
				return "STATUS(" + status + ")";
		}
	}
}
